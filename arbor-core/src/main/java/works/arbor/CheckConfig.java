package works.arbor;

import static java.util.Objects.requireNonNull;

/**
 * Settings for a well-formedness check.
 * <p>
 * Most callers want {@link #simple()}, which matches the behaviour of
 * {@link Completable#checkWellFormed()}.
 */
public final class CheckConfig {
	private final boolean registerRoot;
	private final TypeNaming typeNaming;

	private CheckConfig(boolean registerRoot, TypeNaming typeNaming) {
		this.registerRoot = registerRoot;
		this.typeNaming = typeNaming;
	}

	public static CheckConfig simple() {
		return SIMPLE_CONFIG;
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * If true, the node at which the check starts is itself registered
	 * before any of its descendants, so links pointing at the root resolve.
	 * Otherwise, only nodes reachable through owning edges are registered.
	 */
	public boolean registerRoot() {
		return registerRoot;
	}

	public TypeNaming typeNaming() {
		return typeNaming;
	}

	/**
	 * How node classes are rendered in diagnostics.
	 */
	public enum TypeNaming {
		SIMPLE {
			@Override
			public String nameOf(Class<?> type) {
				return type.getSimpleName();
			}
		},
		QUALIFIED {
			@Override
			public String nameOf(Class<?> type) {
				return type.getName();
			}
		};

		public abstract String nameOf(Class<?> type);
	}

	public static class Builder {
		private boolean registerRoot;
		private TypeNaming typeNaming;

		Builder() {
			registerRoot = false;
			typeNaming = TypeNaming.SIMPLE;
		}

		public Builder registerRoot(boolean registerRoot) {
			this.registerRoot = registerRoot;
			return this;
		}

		public Builder typeNaming(TypeNaming typeNaming) {
			this.typeNaming = requireNonNull(typeNaming);
			return this;
		}

		public CheckConfig build() {
			return new CheckConfig(registerRoot, typeNaming);
		}

		@Override
		public String toString() {
			return "CheckConfig.Builder(registerRoot=" + this.registerRoot + ", typeNaming=" + this.typeNaming + ")";
		}
	}

	@Override
	public String toString() {
		return "CheckConfig(registerRoot=" + registerRoot + ", typeNaming=" + typeNaming + ")";
	}

	private static final CheckConfig SIMPLE_CONFIG = new CheckConfig(false, TypeNaming.SIMPLE);
}

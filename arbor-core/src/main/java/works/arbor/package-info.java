/**
 * Runtime support for generated tree classes.
 * <p>
 * Generated nodes extend {@link works.arbor.TreeNode} and declare their fields as
 * {@link works.arbor.Edge edges}: the owning containers {@link works.arbor.Maybe},
 * {@link works.arbor.One}, {@link works.arbor.Any} and {@link works.arbor.Many},
 * and the weak containers {@link works.arbor.OptLink} and {@link works.arbor.Link}.
 * A finished tree is verified by {@link works.arbor.Completable#checkWellFormed()}.
 */
package works.arbor;

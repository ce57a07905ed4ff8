/**
 * A mutable JSON document tree with a configurable parser and generator.
 * <p>
 * The major packages are:
 *
 * <ul>
 *     <li>
 *         {@link works.bosk.jsontree.value},
 *         the tree model, including {@link works.bosk.jsontree.value.NodeReference NodeReference}
 *         for creating nodes along a path;
 *     </li>
 *     <li>
 *         {@link works.bosk.jsontree.codec},
 *         which converts between trees and JSON text; and
 *     </li>
 *     <li>
 *         {@link works.bosk.jsontree.collections},
 *         home of the ordered container that backs JSON objects.
 *     </li>
 * </ul>
 * Most callers need only {@link works.bosk.jsontree.Json}.
 */
module works.bosk.jsontree {
	requires org.slf4j;

	exports works.bosk.jsontree;
	exports works.bosk.jsontree.codec;
	exports works.bosk.jsontree.codec.io;
	exports works.bosk.jsontree.collections;
	exports works.bosk.jsontree.exceptions;
	exports works.bosk.jsontree.value;
}

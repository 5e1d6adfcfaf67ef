/**
 * Tool description tree and its canonical ordering.
 *
 * <ul>
 *   <li>{@link com.q2galaxy.tooltree.ToolNode} – element with tag, attributes, children and text</li>
 *   <li>{@link com.q2galaxy.tooltree.ToolTreeJson} – {@code fromJson}/{@code toJson}</li>
 *   <li>{@link com.q2galaxy.tooltree.order} – {@link com.q2galaxy.tooltree.order.CanonicalOrder#canonicalize canonicalize},
 *       attribute and section priority lists</li>
 * </ul>
 */
package com.q2galaxy.tooltree;

/**
 * Escape codec for Galaxy tool parameter values.
 * <ul>
 *   <li>{@link com.q2galaxy.escape.GalaxyValue} – text or one of the absent/true/false sentinels</li>
 *   <li>{@link com.q2galaxy.escape.GalaxyEscape} – {@code encode}/{@code decode} over the ordered
 *       {@link com.q2galaxy.escape.GalaxyEscape#ESCAPE_TABLE} and the {@link com.q2galaxy.escape.Sentinel} tokens</li>
 *   <li>{@link com.q2galaxy.escape.GalaxyUiVar} – one-way control and GUI path placeholders</li>
 * </ul>
 */
package com.q2galaxy.escape;

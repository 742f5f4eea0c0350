/**
 * This package defines the in-memory IR: {@link io.github.eutro.irgraph.core.ir.Operation operations}
 * own {@link io.github.eutro.irgraph.core.ir.Region regions}, which own
 * {@link io.github.eutro.irgraph.core.ir.Block blocks}, which own operations again.
 * <p>
 * Values are in static single assignment form: each {@link io.github.eutro.irgraph.core.ir.Value}
 * is defined exactly once, either as the result of an operation or as the argument of a block,
 * and every use is tracked as an {@link io.github.eutro.irgraph.core.ir.OpOperand}.
 * <p>
 * Back-references (operation to block, block to region, region to operation) are stored as
 * {@link io.github.eutro.irgraph.core.ext.CommonExts owner exts}, and are maintained by the
 * owning lists, so moving an operation is just removing it from one list and adding it to another.
 * <p>
 * The textual form of this IR is read and written by the {@link io.github.eutro.irgraph.core.text} package.
 */
package io.github.eutro.irgraph.core.ir;

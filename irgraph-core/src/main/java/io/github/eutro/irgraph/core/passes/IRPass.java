package io.github.eutro.irgraph.core.passes;

/**
 * A pass to run on some part of the IR, which may inspect or modify it,
 * and computes some result.
 *
 * @param <A> The input type.
 * @param <B> The result type.
 */
@FunctionalInterface
public interface IRPass<A, B> {
    /**
     * Run the pass.
     *
     * @param a The IR to run it on.
     * @return The result.
     */
    B run(A a);
}

package org.shadelang.runtime.builtins;

/**
 * Host implementation of a builtin. Arguments arrive in declaration order as
 * {@link Float} or {@link Vec3} values.
 */
@FunctionalInterface
public interface NativeImplementation {
    Object invoke(Object[] args);
}

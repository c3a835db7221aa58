package org.shadelang.runtime.builtins;

/**
 * Native implementations of the vector library.
 */
public class VectorOperators {

    public static Vec3 construct(float x, float y, float z) {
        return new Vec3(x, y, z);
    }

    public static Vec3 scale(Vec3 v, float a) {
        return new Vec3(v.x * a, v.y * a, v.z * a);
    }

    public static Vec3 add(Vec3 a, Vec3 b) {
        return new Vec3(a.x + b.x, a.y + b.y, a.z + b.z);
    }

    // A zero vector normalizes to NaN components, as the division by a zero length yields
    public static Vec3 normalize(Vec3 a) {
        float len = (float) Math.sqrt(a.x * a.x + a.y * a.y + a.z * a.z);
        return new Vec3(a.x / len, a.y / len, a.z / len);
    }

    public static float dot(Vec3 a, Vec3 b) {
        return a.x * b.x + a.y * b.y + a.z * b.z;
    }
}

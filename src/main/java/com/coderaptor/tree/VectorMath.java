package com.coderaptor.tree;

public final class VectorMath {
    private VectorMath() {
    }

    public static boolean isUsable(float[] vector) {
        if (vector == null || vector.length == 0) {
            return false;
        }
        double norm = 0.0;
        for (float value : vector) {
            if (!Float.isFinite(value)) {
                return false;
            }
            norm += value * value;
        }
        return norm > 0.0;
    }

    public static double cosine(float[] left, float[] right) {
        if (left.length != right.length) {
            return 0.0;
        }
        double dot = 0.0;
        double leftNorm = 0.0;
        double rightNorm = 0.0;
        for (int i = 0; i < left.length; i++) {
            dot += left[i] * right[i];
            leftNorm += left[i] * left[i];
            rightNorm += right[i] * right[i];
        }
        if (leftNorm == 0.0 || rightNorm == 0.0) {
            return 0.0;
        }
        return dot / (Math.sqrt(leftNorm) * Math.sqrt(rightNorm));
    }
}

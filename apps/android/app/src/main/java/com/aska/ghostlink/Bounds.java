package com.aska.ghostlink;

/**
 * 屏幕矩形（设备像素，left/top 包含，right/bottom 不包含）
 */
public final class Bounds {

    public final int left;
    public final int top;
    public final int right;
    public final int bottom;

    public Bounds(int left, int top, int right, int bottom) {
        this.left = left;
        this.top = top;
        this.right = right;
        this.bottom = bottom;
    }

    public static Bounds ofSize(int width, int height) {
        return new Bounds(0, 0, width, height);
    }

    public int width() {
        return right - left;
    }

    public int height() {
        return bottom - top;
    }

    /**
     * 面积，宽或高非正时为 0
     */
    public long area() {
        int w = width();
        int h = height();
        if (w <= 0 || h <= 0) return 0L;
        return (long) w * h;
    }

    public int centerX() {
        return (left + right) / 2;
    }

    public int centerY() {
        return (top + bottom) / 2;
    }

    public boolean contains(int x, int y) {
        return left < right && top < bottom
            && x >= left && x < right && y >= top && y < bottom;
    }

    /**
     * 与另一个矩形的相交面积
     */
    public long intersectionArea(Bounds other) {
        int w = Math.min(right, other.right) - Math.max(left, other.left);
        int h = Math.min(bottom, other.bottom) - Math.max(top, other.top);
        if (w <= 0 || h <= 0) return 0L;
        return (long) w * h;
    }

    /**
     * 在 screen 内可见的面积比例；零面积视为 0，完全覆盖屏幕视为 1
     */
    public float visibleFraction(Bounds screen) {
        long total = area();
        if (total <= 0) return 0f;
        if (left <= screen.left && top <= screen.top
                && right >= screen.right && bottom >= screen.bottom) {
            return 1f;
        }
        return (float) ((double) intersectionArea(screen) / total);
    }

    /**
     * x,y,w,h 形式
     */
    public String toCompactString() {
        return left + "," + top + "," + width() + "," + height();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Bounds)) return false;
        Bounds other = (Bounds) o;
        return left == other.left && top == other.top
            && right == other.right && bottom == other.bottom;
    }

    @Override
    public int hashCode() {
        int result = left;
        result = 31 * result + top;
        result = 31 * result + right;
        result = 31 * result + bottom;
        return result;
    }

    @Override
    public String toString() {
        return "(" + left + "," + top + "," + right + "," + bottom + ")";
    }
}

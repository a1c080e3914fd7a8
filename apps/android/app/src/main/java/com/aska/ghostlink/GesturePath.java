package com.aska.ghostlink;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 手势路径（设备像素坐标），对应无障碍 GestureDescription 的一条 stroke
 */
public final class GesturePath {

    private final List<int[]> points;

    private GesturePath(List<int[]> points) {
        this.points = Collections.unmodifiableList(points);
    }

    /**
     * 单点（点击、长按）
     */
    public static GesturePath point(int x, int y) {
        List<int[]> points = new ArrayList<>(1);
        points.add(new int[]{x, y});
        return new GesturePath(points);
    }

    /**
     * 直线（滑动、拖动）
     */
    public static GesturePath line(int startX, int startY, int endX, int endY) {
        List<int[]> points = new ArrayList<>(2);
        points.add(new int[]{startX, startY});
        points.add(new int[]{endX, endY});
        return new GesturePath(points);
    }

    public List<int[]> getPoints() {
        return points;
    }

    public int[] start() {
        return points.get(0);
    }

    public int[] end() {
        return points.get(points.size() - 1);
    }

    public boolean isPoint() {
        return points.size() == 1;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int[] p : points) {
            if (sb.length() > 0) sb.append("->");
            sb.append('(').append(p[0]).append(", ").append(p[1]).append(')');
        }
        return sb.toString();
    }
}

package com.aska.ghostlink;

import com.google.gson.annotations.SerializedName;

/**
 * 精简后的 UI 元素，每个保留的 RawNode 对应一个
 */
public final class CompactElement {

    /**
     * 显示文本（text 优先，其次 contentDescription），最多 80 字符 + 省略号
     */
    @SerializedName("text")
    public final String displayText;

    /**
     * x,y,w,h
     */
    @SerializedName("bounds")
    public final String bounds;

    /**
     * 完整 resourceId，用于精确回查
     */
    @SerializedName("resourceId")
    public final String resourceId;

    @SerializedName("className")
    public final String shortClassName;

    /**
     * c=clickable l=longClickable e=editable f=focused s=selected k=checked
     */
    @SerializedName("flags")
    public final String flagString;

    public CompactElement(String displayText, String bounds, String resourceId,
                          String shortClassName, String flagString) {
        this.displayText = displayText;
        this.bounds = bounds;
        this.resourceId = resourceId;
        this.shortClassName = shortClassName;
        this.flagString = flagString;
    }

    /**
     * 单行文本形式：[Button] 登录 @540,1200,200,80 #com.app:id/login c
     */
    public String toLine() {
        StringBuilder sb = new StringBuilder();
        if (!shortClassName.isEmpty()) {
            sb.append('[').append(shortClassName).append("] ");
        }
        sb.append(displayText);
        sb.append(" @").append(bounds);
        if (!resourceId.isEmpty()) {
            sb.append(" #").append(resourceId);
        }
        if (!flagString.isEmpty()) {
            sb.append(' ').append(flagString);
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CompactElement)) return false;
        CompactElement other = (CompactElement) o;
        return displayText.equals(other.displayText)
            && bounds.equals(other.bounds)
            && resourceId.equals(other.resourceId)
            && shortClassName.equals(other.shortClassName)
            && flagString.equals(other.flagString);
    }

    @Override
    public int hashCode() {
        int result = displayText.hashCode();
        result = 31 * result + bounds.hashCode();
        result = 31 * result + resourceId.hashCode();
        result = 31 * result + shortClassName.hashCode();
        result = 31 * result + flagString.hashCode();
        return result;
    }

    @Override
    public String toString() {
        return toLine();
    }
}

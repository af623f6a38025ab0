package com.face.matching.model;

import com.face.matching.exception.UnknownPolicyException;

/**
 * 匹配模式
 */
public enum MatchMode {

    /**
     * 任意参考人脸出现即命中
     */
    INDIVIDUALLY("individually"),

    /**
     * 所有参考人脸都出现在同一张图中才命中
     */
    TOGETHER("together");

    private final String value;

    MatchMode(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * 严格匹配"individually"或"together"，其他取值（包括大小写或空白不同）均视为未知策略
     */
    public static MatchMode fromString(String mode) {
        for (MatchMode m : values()) {
            if (m.value.equals(mode)) {
                return m;
            }
        }
        throw new UnknownPolicyException(mode);
    }
}

package com.candor.core.domain;

import com.candor.core.exception.ValidationException;

/**
 * Report categories. The numeric code is what gets sealed.
 */
public enum ReportCategory {
    CORRUPTION(0),
    FRAUD(1),
    ENVIRONMENTAL(2),
    SAFETY(3),
    DISCRIMINATION(4),
    OTHER(5);

    private final int code;

    ReportCategory(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static ReportCategory fromCode(int code) {
        for (ReportCategory category : values()) {
            if (category.code == code) {
                return category;
            }
        }
        throw new ValidationException("Invalid category: " + code);
    }
}

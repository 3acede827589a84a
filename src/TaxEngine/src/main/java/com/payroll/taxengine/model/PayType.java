package com.payroll.taxengine.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.payroll.taxengine.error.InvalidInputException;

public enum PayType {
    SALARY("salary"),
    HOURLY("hourly");

    private final String code;

    PayType(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static PayType fromCode(String code) {
        if (code == null) {
            throw new InvalidInputException("pay_type", "pay_type is required");
        }
        return switch (code.trim().toLowerCase()) {
            case "salary", "salaried" -> SALARY;
            case "hourly" -> HOURLY;
            default -> throw new InvalidInputException("pay_type", "Unknown pay type '" + code + "'");
        };
    }
}

package com.jointcalc.model;

public enum UtilizationClass {
    OK,
    MARGINAL,
    OVERLOAD
}

package com.lendora.lending.domain;

public enum CollateralMovementType {
    POST,
    WITHDRAW,
    SEIZE,
    RELEASE
}

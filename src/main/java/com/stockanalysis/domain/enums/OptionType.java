package com.stockanalysis.domain.enums;

public enum OptionType {
    CE,
    PE
}

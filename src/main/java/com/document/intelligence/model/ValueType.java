package com.document.intelligence.model;

public enum ValueType { TEXT, INTEGER, AMOUNT, DATE, LINE_ITEMS }

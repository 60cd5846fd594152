package com.document.intelligence.model;

public enum ConfidenceLevel { HIGH, MEDIUM, LOW }

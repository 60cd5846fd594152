package com.document.intelligence.model;

public enum Routing { AUTO_COMMIT, REVIEW, FAIL }

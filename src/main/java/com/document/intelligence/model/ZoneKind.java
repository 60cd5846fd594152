package com.document.intelligence.model;

public enum ZoneKind { HEADER, TABLE, FOOTER, LOGO, OTHER }

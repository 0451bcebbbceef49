package com.treewalk;

public enum Severity {
    ERROR
}

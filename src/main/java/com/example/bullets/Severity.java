package com.example.bullets;

public enum Severity { LOW, MEDIUM, HIGH, CRITICAL }

package com.ryvin.matching.model;

public record CategoryScore(String category, double score, double weightTotal, int fieldCount) {}

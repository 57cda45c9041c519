package com.hybridforecast.domain;

public record SegmentAssignment(DimensionalKey key, String segmentName) {}

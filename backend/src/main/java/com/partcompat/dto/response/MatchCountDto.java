package com.partcompat.dto.response;

/**
 * Number of distinct equipment records matched by a candidate rule set.
 */
public record MatchCountDto(int count) {}

package com.portfolio.projection.domain.model;

public record PathPoint(int year, double portfolioValue) {
}

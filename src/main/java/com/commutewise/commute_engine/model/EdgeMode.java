package com.commutewise.commute_engine.model;

public enum EdgeMode {
    WALK, RIDE
}

package com.commutewise.commute_engine.model;

public enum TerminalCategory {
    BUS, JEEP, E_JEEP, TRICYCLE, MIXED
}

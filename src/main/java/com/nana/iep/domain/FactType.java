package com.nana.iep.domain;

/**
 * Kind of atomic fact recovered from a packed extract column.
 */
public enum FactType {

    /** A learning session (a meeting held with the student). */
    SESSION,

    /** An IEP goal entry carrying a category and a status. */
    GOAL
}

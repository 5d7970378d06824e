package com.jmapmail.domain;

public enum ChangeOp {
    CREATE,
    UPDATE,
    DESTROY
}

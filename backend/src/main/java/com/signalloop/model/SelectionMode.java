package com.signalloop.model;

public enum SelectionMode {
    EXPLORE,
    EXPLOIT
}

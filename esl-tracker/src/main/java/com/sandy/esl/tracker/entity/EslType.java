package com.sandy.esl.tracker.entity;

/**
 * Device family of an electronic shelf label.
 * Stored by name, both in JSON payloads and in the {@code type} column.
 */
public enum EslType {
    Hanshow,
    Pricer,
    EasyVCO
}

package com.server.skillsync.match.enums;

/**
 * 匹配生成的来源
 */
public enum TriggerSource {
    EVENT,
    MANUAL,
    RECONCILIATION
}

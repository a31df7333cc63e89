package com.sunny.conduit.job.core.enums;

/**
 * 条件组合方式
 *
 * @author SunnyX6
 * @date 2026-03-03
 */
public enum MatchMode {

    /**
     * 全部条件满足
     */
    ALL,

    /**
     * 任一条件满足
     */
    ANY
}

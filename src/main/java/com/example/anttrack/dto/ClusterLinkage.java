package com.example.anttrack.dto;

public enum ClusterLinkage {
    /** 最近成员距离 */
    SINGLE,
    /** 平均成对距离 */
    AVERAGE
}

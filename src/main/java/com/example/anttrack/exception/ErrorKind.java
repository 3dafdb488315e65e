package com.example.anttrack.exception;

/**
 * 分析过程中的错误类别
 */
public enum ErrorKind {
    /** 空帧或损坏帧：跳过并继续 */
    EMPTY_FRAME,
    /** 本帧没有检测结果：正常结果，不是错误 */
    NO_DETECTIONS,
    /** 聚类失败：退化为单元素分组 */
    CLUSTERING_FAILURE,
    /** 等代价的匹配冲突：按最小轨迹ID解决 */
    ASSIGNMENT_AMBIGUITY,
    /** 视频源在预期结束前无法继续读帧：当前视频失败，批处理继续 */
    CORRUPT_SOURCE,
    /** 单帧内部异常：本帧不更新 */
    INTERNAL
}

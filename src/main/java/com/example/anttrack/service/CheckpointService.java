package com.example.anttrack.service;

import com.example.anttrack.dto.TrackingCheckpoint;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

public interface CheckpointService {

    /**
     * 原子地保存断点：先写临时文件再替换目标
     * @param path 断点文件路径
     * @param checkpoint 跟踪器状态
     */
    void save(Path path, TrackingCheckpoint checkpoint) throws IOException;

    /**
     * 读取断点
     * @param path 断点文件路径
     * @return 文件不存在时为空
     */
    Optional<TrackingCheckpoint> load(Path path) throws IOException;

    /**
     * 删除断点文件
     */
    void delete(Path path) throws IOException;
}

package com.example.anttrack.service.source;

/**
 * 惰性、有限、只进的帧序列
 */
public interface FrameSource extends AutoCloseable {

    /**
     * 读取下一帧
     *
     * @return 下一帧，读到结尾时返回 null
     * @throws com.example.anttrack.exception.AnalysisException CORRUPT_SOURCE：预期结尾之前无法继续读帧
     */
    VideoFrame next();

    /**
     * 下一次 {@link #next()} 返回的帧号
     */
    long position();

    /**
     * 总帧数，未知时返回 -1
     */
    long getFrameCount();

    double getFrameRate();

    default boolean isSeekable() {
        return false;
    }

    /**
     * 定位到指定帧，只有 {@link #isSeekable()} 为 true 的源才支持
     */
    default void seek(long frameIndex) {
        throw new UnsupportedOperationException("帧源不支持定位");
    }

    /**
     * 跳到指定帧：可定位时直接定位，否则逐帧读取并丢弃
     */
    default void skipTo(long frameIndex) {
        if (frameIndex <= position()) {
            return;
        }
        if (isSeekable()) {
            seek(frameIndex);
            return;
        }
        while (position() < frameIndex) {
            VideoFrame frame = next();
            if (frame == null) {
                return;
            }
            frame.close();
        }
    }

    @Override
    void close();
}

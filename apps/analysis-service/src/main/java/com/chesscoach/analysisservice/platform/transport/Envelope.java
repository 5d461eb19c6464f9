package com.chesscoach.analysisservice.platform.transport;

import java.io.Serial;
import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * 传输消息外壳（WebSocket 推送通用）
 * - 强类型泛型载荷：Envelope<T>
 * - 最少字段：kind / channel / requestId / payload / ts / seq
 * - 提供静态工厂：state/event/done/error/of
 *
 * 用法示例：
 *   Envelope<EvaluationResult> msg = Envelope.state("analysis", requestId, result);
 *   Envelope<PlyAnalysis>      ply = Envelope.of(Kind.EVENT, "analysis", requestId, entry, seq);
 *   Envelope<ErrorPayload>     err = Envelope.error("analysis", requestId, payload);
 */
public final class Envelope<T> implements Serializable {
    @Serial private static final long serialVersionUID = 1L;

    /** 消息类别：STATE=完整结果，EVENT=逐手增量，DONE=流结束，ERROR=错误通知 */
    public enum Kind { STATE, EVENT, DONE, ERROR }

    private final Kind kind;
    private final String channel;   // analysis / rating ...
    private final String requestId;
    private final T payload;
    private final long ts;          // 服务器时间戳（ms）
    private final long seq;         // 同一 requestId 内递增序号，没有就传 0

    private Envelope(Kind kind, String channel, String requestId, T payload, long ts, long seq) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.channel = Objects.requireNonNull(channel, "channel");
        this.requestId = Objects.requireNonNull(requestId, "requestId");
        this.payload = payload;
        this.ts = ts;
        this.seq = seq;
    }

    /** 自由构造（若不关心 seq，传 0） */
    public static <T> Envelope<T> of(Kind kind, String channel, String requestId, T payload, long seq) {
        return new Envelope<>(kind, channel, requestId, payload, Instant.now().toEpochMilli(), seq);
    }

    /** 完整结果（单局面分析） */
    public static <T> Envelope<T> state(String channel, String requestId, T payload) {
        return of(Kind.STATE, channel, requestId, payload, 0);
    }

    /** 流结束标记（整盘分析的最后一条消息） */
    public static <T> Envelope<T> done(String channel, String requestId, T payload, long seq) {
        return of(Kind.DONE, channel, requestId, payload, seq);
    }

    /** 错误通知 */
    public static <T> Envelope<T> error(String channel, String requestId, T payload) {
        return of(Kind.ERROR, channel, requestId, payload, 0);
    }

    // ----------- getters（不可变对象，无 setters） -----------
    public Kind getKind()        { return kind; }
    public String getChannel()   { return channel; }
    public String getRequestId() { return requestId; }
    public T getPayload()         { return payload; }
    public long getTs()          { return ts; }
    public long getSeq()         { return seq; }

    @Override public String toString() {
        return "Envelope{" +
                "kind=" + kind +
                ", channel='" + channel + '\'' +
                ", requestId='" + requestId + '\'' +
                ", ts=" + ts +
                ", seq=" + seq +
                '}';
    }
}

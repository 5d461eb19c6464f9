package com.chesscoach.analysisservice.engine.core;

import com.chesscoach.analysisservice.common.exception.InvalidParameterException;

import java.util.List;

/**
 * 单次搜索参数，按请求构造，不可变。
 *
 * @param depth       搜索深度，[5,30]
 * @param multiPv     返回的候选线数，[1,5]
 * @param searchMoves 只在这些着法（UCI）里搜索；为空表示不限制
 */
public record SearchParameters(int depth, int multiPv, List<String> searchMoves) {

    public static final int MIN_DEPTH = 5;
    public static final int MAX_DEPTH = 30;
    public static final int MIN_MULTI_PV = 1;
    public static final int MAX_MULTI_PV = 5;

    public SearchParameters {
        if (depth < MIN_DEPTH || depth > MAX_DEPTH) {
            throw new InvalidParameterException("depth", "应在 [" + MIN_DEPTH + "," + MAX_DEPTH + "] 之间，实际 " + depth);
        }
        if (multiPv < MIN_MULTI_PV || multiPv > MAX_MULTI_PV) {
            throw new InvalidParameterException("multiPv", "应在 [" + MIN_MULTI_PV + "," + MAX_MULTI_PV + "] 之间，实际 " + multiPv);
        }
        searchMoves = searchMoves == null ? List.of() : List.copyOf(searchMoves);
    }

    public static SearchParameters of(int depth, int multiPv) {
        return new SearchParameters(depth, multiPv, List.of());
    }

    /** 引擎实际可返回的线数：限制了候选着法时不会超过候选数 */
    public int effectiveLines() {
        return searchMoves.isEmpty() ? multiPv : Math.min(multiPv, searchMoves.size());
    }
}

package com.chesscoach.analysisservice.games.chess.interfaces.http.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class MoveCheckBody {
    @NotBlank
    private String fen;
    /** 待判定的着法（UCI） */
    @NotBlank
    private String move;
}

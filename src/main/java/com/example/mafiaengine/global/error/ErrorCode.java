package com.example.mafiaengine.global.error;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public enum ErrorCode {
    // 능력 큐 검증
    INVALID_TARGET(HttpStatus.BAD_REQUEST, "INVALID_TARGET", "Invalid target"),
    INVALID_TARGET_COUNT(HttpStatus.BAD_REQUEST, "INVALID_TARGET_COUNT", "Invalid target count"),
    INELIGIBLE_NOW(HttpStatus.BAD_REQUEST, "INELIGIBLE_NOW", "Ability cannot be used now"),
    UNKNOWN_ABILITY(HttpStatus.BAD_REQUEST, "UNKNOWN_ABILITY", "Unknown ability"),

    // 페이즈 / 게임 상태
    ILLEGAL_PHASE_TRANSITION(HttpStatus.CONFLICT, "ILLEGAL_PHASE_TRANSITION", "Illegal phase transition"),
    GAME_ALREADY_RESOLVED(HttpStatus.CONFLICT, "GAME_ALREADY_RESOLVED", "Game already resolved"),
    NOT_VOTING_PHASE(HttpStatus.BAD_REQUEST, "NOT_VOTING_PHASE", "Not a voting phase"),
    INVALID_GAME_SETUP(HttpStatus.BAD_REQUEST, "INVALID_GAME_SETUP", "Invalid game setup"),

    // 조회
    GAME_NOT_FOUND(HttpStatus.NOT_FOUND, "GAME_NOT_FOUND", "Game not found"),
    PLAYER_NOT_FOUND(HttpStatus.NOT_FOUND, "PLAYER_NOT_FOUND", "Player not found"),
    CHAT_NOT_FOUND(HttpStatus.NOT_FOUND, "CHAT_NOT_FOUND", "Chat not found"),

    // 권한
    NOT_AUTHENTICATED(HttpStatus.UNAUTHORIZED, "NOT_AUTHENTICATED", "Not authenticated"),
    FORBIDDEN(HttpStatus.FORBIDDEN, "FORBIDDEN", "Not the moderator or the player"),
    CHAT_WRITE_DENIED(HttpStatus.FORBIDDEN, "CHAT_WRITE_DENIED", "Not allowed to write to this chat"),
    ;
    private final String code;
    private final String message;
    private final HttpStatus status;

    ErrorCode(HttpStatus status, String code, String message) {
        this.status = status;
        this.message = message;
        this.code = code;
    }

    public CommonException commonException() {return new CommonException(this);}

    public CommonException commonException(String detail) {return new CommonException(this, detail);}
}

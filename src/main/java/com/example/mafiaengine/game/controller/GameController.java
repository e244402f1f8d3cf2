package com.example.mafiaengine.game.controller;

import com.example.mafiaengine.game.domain.Viewer;
import com.example.mafiaengine.game.dto.request.CreateGameRequest;
import com.example.mafiaengine.game.dto.request.PatchGameRequest;
import com.example.mafiaengine.game.dto.request.QueueAbilitiesRequest;
import com.example.mafiaengine.game.dto.request.UpdateGameRequest;
import com.example.mafiaengine.game.dto.request.VoteRequest;
import com.example.mafiaengine.game.dto.response.AbilityListResponse;
import com.example.mafiaengine.game.dto.response.CatalogResponse;
import com.example.mafiaengine.game.dto.response.CreateGameResponse;
import com.example.mafiaengine.game.dto.response.GameOverviewResponse;
import com.example.mafiaengine.game.dto.response.PlayerView;
import com.example.mafiaengine.game.dto.response.VoteTallyResponse;
import com.example.mafiaengine.game.resolution.ResolutionLogEntry;
import com.example.mafiaengine.game.service.GameService;
import com.example.mafiaengine.global.dto.CommonResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/games")
@RequiredArgsConstructor
public class GameController {

    public static final String MOD_TOKEN_HEADER = "Authorization-Mod-Token";
    public static final String PLAYER_NAME_HEADER = "Authorization-Player-Name";

    private final GameService gameService;

    @PostMapping
    public ResponseEntity<CommonResponse<CreateGameResponse>> createGame(
            @Valid @RequestBody CreateGameRequest request) {
        CreateGameResponse response = gameService.createGame(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(CommonResponse.success(response, "게임 생성 성공"));
    }

    @GetMapping("/catalog")
    public ResponseEntity<CommonResponse<CatalogResponse>> getCatalog() {
        return ResponseEntity.ok(CommonResponse.success(gameService.catalog(), null));
    }

    @GetMapping("/{gameId}")
    public ResponseEntity<CommonResponse<GameOverviewResponse>> getOverview(
            @PathVariable String gameId,
            @RequestHeader(value = MOD_TOKEN_HEADER, required = false) String modToken,
            @RequestHeader(value = PLAYER_NAME_HEADER, required = false) String playerName) {
        Viewer viewer = gameService.resolveViewer(gameId, modToken, playerName);
        return ResponseEntity.ok(CommonResponse.success(gameService.getOverview(gameId, viewer), null));
    }

    @PutMapping("/{gameId}")
    public ResponseEntity<CommonResponse<GameOverviewResponse>> setTime(
            @PathVariable String gameId,
            @Valid @RequestBody UpdateGameRequest request,
            @RequestHeader(value = MOD_TOKEN_HEADER, required = false) String modToken) {
        Viewer viewer = gameService.resolveViewer(gameId, modToken, null);
        return ResponseEntity.ok(CommonResponse.success(gameService.setTime(gameId, viewer, request), "시간 변경"));
    }

    @PatchMapping("/{gameId}")
    public ResponseEntity<CommonResponse<GameOverviewResponse>> applyActions(
            @PathVariable String gameId,
            @Valid @RequestBody PatchGameRequest request,
            @RequestHeader(value = MOD_TOKEN_HEADER, required = false) String modToken) {
        Viewer viewer = gameService.resolveViewer(gameId, modToken, null);
        GameOverviewResponse response = gameService.applyActions(gameId, viewer, request.actions());
        return ResponseEntity.ok(CommonResponse.success(response, null));
    }

    @GetMapping("/{gameId}/players")
    public ResponseEntity<CommonResponse<List<PlayerView>>> getPlayers(
            @PathVariable String gameId,
            @RequestHeader(value = MOD_TOKEN_HEADER, required = false) String modToken,
            @RequestHeader(value = PLAYER_NAME_HEADER, required = false) String playerName) {
        Viewer viewer = gameService.resolveViewer(gameId, modToken, playerName);
        return ResponseEntity.ok(CommonResponse.success(gameService.getPlayers(gameId, viewer), null));
    }

    @GetMapping("/{gameId}/log")
    public ResponseEntity<CommonResponse<List<ResolutionLogEntry>>> getResolutionLog(
            @PathVariable String gameId,
            @RequestHeader(value = MOD_TOKEN_HEADER, required = false) String modToken) {
        Viewer viewer = gameService.resolveViewer(gameId, modToken, null);
        return ResponseEntity.ok(CommonResponse.success(gameService.getResolutionLog(gameId, viewer), null));
    }

    // ================= 능력 =================

    @GetMapping("/{gameId}/players/{name}/abilities")
    public ResponseEntity<CommonResponse<AbilityListResponse>> getAbilities(
            @PathVariable String gameId,
            @PathVariable String name,
            @RequestHeader(value = MOD_TOKEN_HEADER, required = false) String modToken,
            @RequestHeader(value = PLAYER_NAME_HEADER, required = false) String playerName) {
        Viewer viewer = gameService.resolveViewer(gameId, modToken, playerName);
        return ResponseEntity.ok(CommonResponse.success(gameService.getAbilities(gameId, viewer, name), null));
    }

    @PostMapping("/{gameId}/players/{name}/abilities")
    public ResponseEntity<CommonResponse<AbilityListResponse>> queueAbilities(
            @PathVariable String gameId,
            @PathVariable String name,
            @RequestBody QueueAbilitiesRequest request,
            @RequestHeader(value = MOD_TOKEN_HEADER, required = false) String modToken,
            @RequestHeader(value = PLAYER_NAME_HEADER, required = false) String playerName) {
        Viewer viewer = gameService.resolveViewer(gameId, modToken, playerName);
        AbilityListResponse response = gameService.queueAbilities(gameId, viewer, name, request);
        return ResponseEntity.ok(CommonResponse.success(response, "능력 예약 완료"));
    }

    // ================= 투표 =================

    @GetMapping("/{gameId}/votes")
    public ResponseEntity<CommonResponse<VoteTallyResponse>> getVotes(@PathVariable String gameId) {
        return ResponseEntity.ok(CommonResponse.success(gameService.getVotes(gameId), null));
    }

    @PostMapping("/{gameId}/players/{name}/vote")
    public ResponseEntity<CommonResponse<VoteTallyResponse>> vote(
            @PathVariable String gameId,
            @PathVariable String name,
            @RequestBody(required = false) VoteRequest request,
            @RequestHeader(value = MOD_TOKEN_HEADER, required = false) String modToken,
            @RequestHeader(value = PLAYER_NAME_HEADER, required = false) String playerName) {
        Viewer viewer = gameService.resolveViewer(gameId, modToken, playerName);
        String target = request == null ? null : request.target();
        return ResponseEntity.ok(CommonResponse.success(gameService.vote(gameId, viewer, name, target), "투표 완료"));
    }

    @DeleteMapping("/{gameId}/players/{name}/vote")
    public ResponseEntity<CommonResponse<VoteTallyResponse>> unvote(
            @PathVariable String gameId,
            @PathVariable String name,
            @RequestHeader(value = MOD_TOKEN_HEADER, required = false) String modToken,
            @RequestHeader(value = PLAYER_NAME_HEADER, required = false) String playerName) {
        Viewer viewer = gameService.resolveViewer(gameId, modToken, playerName);
        return ResponseEntity.ok(CommonResponse.success(gameService.unvote(gameId, viewer, name), "투표 취소"));
    }
}

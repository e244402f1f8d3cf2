package com.example.mafiaengine.game.catalog;

import com.example.mafiaengine.game.domain.Alignment;
import com.example.mafiaengine.game.domain.Role;
import com.example.mafiaengine.game.modifier.Modifier;
import com.example.mafiaengine.game.modifier.Modifiers;
import com.example.mafiaengine.global.error.ErrorCode;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 역할 / 진영 / 수식어 템플릿 등록소
 */
@Slf4j
@Component
public class RoleCatalog {

    private final Map<String, Role> roles = new LinkedHashMap<>();
    private final Map<String, Alignment> alignments = new LinkedHashMap<>();

    @PostConstruct
    public void init() {
        StandardRoles.all().forEach(this::registerRole);
        StandardAlignments.all().forEach(this::registerAlignment);
        log.info("[카탈로그] 등록 완료: roles={}, alignments={}", roles.keySet(), alignments.keySet());
    }

    public void registerRole(Role role) {
        if (roles.putIfAbsent(role.getId(), role) != null) {
            throw new IllegalStateException("duplicate role: " + role.getId());
        }
    }

    public void registerAlignment(Alignment alignment) {
        if (alignments.putIfAbsent(alignment.getId(), alignment) != null) {
            throw new IllegalStateException("duplicate alignment: " + alignment.getId());
        }
    }

    public Role role(String id) {
        Role role = roles.get(id);
        if (role == null) {
            throw ErrorCode.INVALID_GAME_SETUP.commonException("unknown role " + id);
        }
        return role;
    }

    /**
     * 기본 역할에 수식어를 순서대로 덧붙인 역할
     */
    public Role role(String id, List<String> modifierIds) {
        List<Modifier> modifiers = modifierIds == null ? List.of() : modifierIds.stream().map(this::modifier).toList();
        return role(id).withModifiers(modifiers);
    }

    public Modifier modifier(String id) {
        return Modifiers.parse(id)
                .orElseThrow(() -> ErrorCode.INVALID_GAME_SETUP.commonException("unknown modifier " + id));
    }

    public Alignment alignment(String id) {
        Alignment alignment = alignments.get(id);
        if (alignment == null) {
            throw ErrorCode.INVALID_GAME_SETUP.commonException("unknown alignment " + id);
        }
        return alignment;
    }

    public Collection<Role> roles() {
        return Collections.unmodifiableCollection(roles.values());
    }

    public Collection<Alignment> alignments() {
        return Collections.unmodifiableCollection(alignments.values());
    }

    public List<String> modifierIds() {
        return Modifiers.knownIds();
    }
}

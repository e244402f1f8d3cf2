package com.example.mafiaengine.chat.domain;

public enum ChatType {
    // 전체 채팅
    GLOBAL,
    // 진영 / 역할 채팅 (마피아, 메이슨)
    GROUP,
    // 플레이어 두 명 사이의 귓속말
    PRIVATE,
    // 능력 결과 등 시스템 메시지를 받는 개인 수신함
    INBOX
}

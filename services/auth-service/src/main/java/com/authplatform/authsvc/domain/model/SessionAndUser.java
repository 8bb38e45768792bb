package com.authplatform.authsvc.domain.model;

public record SessionAndUser(Session session, User user) {
}

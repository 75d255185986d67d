package io.b2mash.b2b.rolepermissions.role.dto;

import io.b2mash.b2b.rolepermissions.member.WorkspaceMember;
import java.time.Instant;
import java.util.UUID;

public record RoleMemberResponse(
    UUID memberId, UUID userId, String email, String name, String systemRole, Instant joinedAt) {

  public static RoleMemberResponse from(WorkspaceMember member) {
    return new RoleMemberResponse(
        member.getId(),
        member.getUserId(),
        member.getEmail(),
        member.getName(),
        member.getRole().value(),
        member.getCreatedAt());
  }
}

package com.jobflow.core;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;

public class InvitePayload {

    @NotBlank
    @Email
    private String email;

    @NotBlank
    private String teamId;

    public InvitePayload() {
    }

    public InvitePayload(String email, String teamId) {
        this.email = email;
        this.teamId = teamId;
    }

    public String getEmail() {
        return email;
    }

    public String getTeamId() {
        return teamId;
    }
}

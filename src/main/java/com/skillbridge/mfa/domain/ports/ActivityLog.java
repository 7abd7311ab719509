package com.skillbridge.mfa.domain.ports;

import com.skillbridge.mfa.domain.mfa.ActivityType;

public interface ActivityLog {

    void record(String userId, ActivityType type, String message);
}

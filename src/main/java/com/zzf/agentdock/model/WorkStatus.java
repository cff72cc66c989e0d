package com.zzf.agentdock.model;

public enum WorkStatus {
    UNKNOWN,
    WORKING,
    WAITING,
    PERMISSION
}

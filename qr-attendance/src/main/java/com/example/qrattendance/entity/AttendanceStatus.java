package com.example.qrattendance.entity;

public enum AttendanceStatus {
    ON_TIME,
    LATE
}

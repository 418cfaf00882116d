package com.example.qrattendance.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class QrCheckInRequest {

    @NotBlank(message = "QR data is required")
    @JsonAlias("qr_data")
    private String qrData;

    @NotBlank(message = "Student ID is required")
    @JsonAlias("student_id")
    private String studentId;
}

package com.example.rooms.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BookingDTO {
    private Long id;
    private Long roomId;
    private String title;
    private String ownerRef;

    /** Naive "yyyy-MM-dd HH:mm:ss", as stored */
    private String startTime;

    private String endTime;
}

package kr.jemi.boxoffice.show.infrastructure.in.web.dto;

import kr.jemi.boxoffice.show.domain.Availability;

public record AvailabilityResponse(long showId, int totalSeats, long booked, long available) {

    public static AvailabilityResponse from(Availability availability) {
        return new AvailabilityResponse(availability.showId(), availability.totalSeats(),
                availability.booked(), availability.available());
    }
}

package kr.jemi.boxoffice.booking.application.service;

import kr.jemi.boxoffice.booking.application.port.out.BookingPort;
import kr.jemi.boxoffice.booking.domain.Booking;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
public class BookingWriter {

    private final BookingPort bookingPort;
    private final ApplicationEventPublisher eventPublisher;

    public BookingWriter(BookingPort bookingPort, ApplicationEventPublisher eventPublisher) {
        this.bookingPort = bookingPort;
        this.eventPublisher = eventPublisher;
    }

    @Transactional
    public Booking insert(Booking booking) {
        List<Object> events = booking.pullEvents();
        Booking saved = bookingPort.insert(booking);
        events.forEach(eventPublisher::publishEvent);
        return saved;
    }

    @Transactional
    public Booking update(Booking booking) {
        List<Object> events = booking.pullEvents();
        Booking saved = bookingPort.update(booking);
        events.forEach(eventPublisher::publishEvent);
        return saved;
    }
}

package kr.jemi.boxoffice.booking.application.service;

import io.hypersistence.tsid.TSID;
import kr.jemi.boxoffice.booking.domain.BookingKey;
import org.springframework.stereotype.Service;

/**
 * 예매 ID는 TSID 값, 예매 코드는 "BK" + TSID 문자열(Crockford Base32 13자리)이다.
 */
@Service
public class BookingCodeGenerator {

    static final String CODE_PREFIX = "BK";

    private final TSID.Factory tsidFactory;

    public BookingCodeGenerator(TSID.Factory tsidFactory) {
        this.tsidFactory = tsidFactory;
    }

    public BookingKey next() {
        TSID tsid = tsidFactory.generate();
        return new BookingKey(tsid.toLong(), CODE_PREFIX + tsid);
    }
}

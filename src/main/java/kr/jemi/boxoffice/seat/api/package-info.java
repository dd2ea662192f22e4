@NamedInterface("api")
package kr.jemi.boxoffice.seat.api;

import org.springframework.modulith.NamedInterface;

@NamedInterface("api")
package kr.jemi.boxoffice.hold.api;

import org.springframework.modulith.NamedInterface;

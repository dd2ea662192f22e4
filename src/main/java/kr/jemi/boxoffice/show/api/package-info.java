@NamedInterface("api")
package kr.jemi.boxoffice.show.api;

import org.springframework.modulith.NamedInterface;

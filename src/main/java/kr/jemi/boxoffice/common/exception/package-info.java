@NamedInterface("exception")
package kr.jemi.boxoffice.common.exception;

import org.springframework.modulith.NamedInterface;

@NamedInterface("dto")
package kr.jemi.boxoffice.common.dto;

import org.springframework.modulith.NamedInterface;

@NamedInterface("validation")
package kr.jemi.boxoffice.common.validation;

import org.springframework.modulith.NamedInterface;

package kr.jemi.boxoffice.hold.infrastructure.in.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

public record HoldRequest(@NotEmpty List<@NotBlank String> seatIds) {
}

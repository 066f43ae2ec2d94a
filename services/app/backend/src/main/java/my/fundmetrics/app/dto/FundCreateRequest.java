package my.fundmetrics.app.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record FundCreateRequest(
		@NotBlank @Size(max = 50) String fundCode,
		@NotBlank @Size(max = 255) String name,
		Boolean active
) {
}

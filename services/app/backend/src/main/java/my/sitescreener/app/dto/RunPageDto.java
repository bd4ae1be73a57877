package my.sitescreener.app.dto;

import java.util.List;

public record RunPageDto(
		List<RunDto> items,
		int total,
		int limit,
		int offset
) {
}

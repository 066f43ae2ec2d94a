package my.fundmetrics.app.dto;

public record FundDto(Long fundId, String fundCode, String name, boolean active) {
}

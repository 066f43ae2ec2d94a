package my.fundmetrics.app.service;

import my.fundmetrics.app.domain.Fund;
import my.fundmetrics.app.domain.FundMetricsSummary;
import my.fundmetrics.app.domain.MetricColumns;
import my.fundmetrics.app.dto.FundCreateRequest;
import my.fundmetrics.app.dto.FundDto;
import my.fundmetrics.app.dto.FundMetricsSummaryDto;
import my.fundmetrics.app.model.MetricName;
import my.fundmetrics.app.repository.FundMetricsSummaryRepository;
import my.fundmetrics.app.repository.FundRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Service
public class FundService {
	private final FundRepository fundRepository;
	private final FundMetricsSummaryRepository summaryRepository;

	public FundService(FundRepository fundRepository, FundMetricsSummaryRepository summaryRepository) {
		this.fundRepository = fundRepository;
		this.summaryRepository = summaryRepository;
	}

	@Transactional(readOnly = true)
	public List<FundDto> list() {
		return fundRepository.findAll().stream().map(this::toDto).toList();
	}

	@Transactional
	public FundDto create(FundCreateRequest request) {
		String code = normalizeCode(request.fundCode());
		if (fundRepository.findByFundCode(code).isPresent()) {
			throw new IllegalArgumentException("Fund code already exists: " + code);
		}
		Fund fund = new Fund();
		fund.setFundCode(code);
		fund.setName(request.name().trim());
		fund.setActive(request.active() == null || request.active());
		fund.setCreatedAt(LocalDateTime.now());
		return toDto(fundRepository.save(fund));
	}

	/**
	 * Returns the fund with this code, creating an active one named {@code name} when absent.
	 */
	@Transactional
	public Fund findOrCreate(String fundCode, String name) {
		String code = normalizeCode(fundCode);
		return fundRepository.findByFundCode(code).orElseGet(() -> {
			Fund fund = new Fund();
			fund.setFundCode(code);
			fund.setName(name == null || name.isBlank() ? code : name.trim());
			fund.setActive(true);
			fund.setCreatedAt(LocalDateTime.now());
			return fundRepository.save(fund);
		});
	}

	@Transactional(readOnly = true)
	public Fund require(Long fundId) {
		return fundRepository.findById(fundId)
				.orElseThrow(() -> new IllegalArgumentException("Fund not found: " + fundId));
	}

	@Transactional(readOnly = true)
	public FundMetricsSummaryDto summary(Long fundId) {
		require(fundId);
		FundMetricsSummary summary = summaryRepository.findById(fundId)
				.orElseThrow(() -> new IllegalArgumentException("No metrics calculated for fund " + fundId));
		Map<String, Double> metrics = new LinkedHashMap<>();
		MetricColumns columns = summary.getMetrics();
		for (MetricName name : MetricName.values()) {
			Double value = columns == null ? null : columns.get(name);
			metrics.put(name.key(), value == null ? 0.0 : value);
		}
		return new FundMetricsSummaryDto(fundId, metrics, summary.getWeightedValuation(),
				summary.getWeightedRevenue(), summary.getWeightedProfit(), summary.getHoldingsCount(),
				summary.getContributingHoldings(), summary.getLastUpdated());
	}

	static String normalizeCode(String fundCode) {
		String code = fundCode == null ? "" : fundCode.trim().toUpperCase(Locale.ROOT);
		if (code.isEmpty()) {
			throw new IllegalArgumentException("Fund code is required");
		}
		return code;
	}

	private FundDto toDto(Fund fund) {
		return new FundDto(fund.getFundId(), fund.getFundCode(), fund.getName(), fund.isActive());
	}
}

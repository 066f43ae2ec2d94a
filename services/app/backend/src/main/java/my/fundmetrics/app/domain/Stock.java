package my.fundmetrics.app.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Entity
@Table(name = "stocks")
public class Stock {
	@Id
	@GeneratedValue(strategy = GenerationType.IDENTITY)
	@Column(name = "stock_id")
	private Long stockId;

	@Column(name = "company_name", nullable = false)
	private String companyName;

	@Column(name = "accord_code", nullable = false, unique = true)
	private String accordCode;

	@Column(name = "sector")
	private String sector;

	@Column(name = "cap")
	private String cap;

	@Column(name = "free_float")
	private BigDecimal freeFloat;

	@Column(name = "revenue_6yr_cagr")
	private BigDecimal revenue6yrCagr;

	@Column(name = "revenue_ttm")
	private BigDecimal revenueTtm;

	@Column(name = "pat_6yr_cagr")
	private BigDecimal pat6yrCagr;

	@Column(name = "pat_ttm")
	private BigDecimal patTtm;

	@Column(name = "pe_current")
	private BigDecimal peCurrent;

	@Column(name = "pe_2yr_avg")
	private BigDecimal pe2yrAvg;

	@Column(name = "pe_reval_deval")
	private BigDecimal peRevalDeval;

	@Column(name = "bse_code")
	private String bseCode;

	@Column(name = "nse_symbol")
	private String nseSymbol;

	@Column(name = "isin")
	private String isin;

	@Column(name = "created_at", nullable = false)
	private LocalDateTime createdAt;

	@Column(name = "updated_at", nullable = false)
	private LocalDateTime updatedAt;

	public Long getStockId() {
		return stockId;
	}

	public void setStockId(Long stockId) {
		this.stockId = stockId;
	}

	public String getCompanyName() {
		return companyName;
	}

	public void setCompanyName(String companyName) {
		this.companyName = companyName;
	}

	public String getAccordCode() {
		return accordCode;
	}

	public void setAccordCode(String accordCode) {
		this.accordCode = accordCode;
	}

	public String getSector() {
		return sector;
	}

	public void setSector(String sector) {
		this.sector = sector;
	}

	public String getCap() {
		return cap;
	}

	public void setCap(String cap) {
		this.cap = cap;
	}

	public BigDecimal getFreeFloat() {
		return freeFloat;
	}

	public void setFreeFloat(BigDecimal freeFloat) {
		this.freeFloat = freeFloat;
	}

	public BigDecimal getRevenue6yrCagr() {
		return revenue6yrCagr;
	}

	public void setRevenue6yrCagr(BigDecimal revenue6yrCagr) {
		this.revenue6yrCagr = revenue6yrCagr;
	}

	public BigDecimal getRevenueTtm() {
		return revenueTtm;
	}

	public void setRevenueTtm(BigDecimal revenueTtm) {
		this.revenueTtm = revenueTtm;
	}

	public BigDecimal getPat6yrCagr() {
		return pat6yrCagr;
	}

	public void setPat6yrCagr(BigDecimal pat6yrCagr) {
		this.pat6yrCagr = pat6yrCagr;
	}

	public BigDecimal getPatTtm() {
		return patTtm;
	}

	public void setPatTtm(BigDecimal patTtm) {
		this.patTtm = patTtm;
	}

	public BigDecimal getPeCurrent() {
		return peCurrent;
	}

	public void setPeCurrent(BigDecimal peCurrent) {
		this.peCurrent = peCurrent;
	}

	public BigDecimal getPe2yrAvg() {
		return pe2yrAvg;
	}

	public void setPe2yrAvg(BigDecimal pe2yrAvg) {
		this.pe2yrAvg = pe2yrAvg;
	}

	public BigDecimal getPeRevalDeval() {
		return peRevalDeval;
	}

	public void setPeRevalDeval(BigDecimal peRevalDeval) {
		this.peRevalDeval = peRevalDeval;
	}

	public String getBseCode() {
		return bseCode;
	}

	public void setBseCode(String bseCode) {
		this.bseCode = bseCode;
	}

	public String getNseSymbol() {
		return nseSymbol;
	}

	public void setNseSymbol(String nseSymbol) {
		this.nseSymbol = nseSymbol;
	}

	public String getIsin() {
		return isin;
	}

	public void setIsin(String isin) {
		this.isin = isin;
	}

	public LocalDateTime getCreatedAt() {
		return createdAt;
	}

	public void setCreatedAt(LocalDateTime createdAt) {
		this.createdAt = createdAt;
	}

	public LocalDateTime getUpdatedAt() {
		return updatedAt;
	}

	public void setUpdatedAt(LocalDateTime updatedAt) {
		this.updatedAt = updatedAt;
	}
}

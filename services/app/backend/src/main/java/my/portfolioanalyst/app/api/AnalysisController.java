package my.portfolioanalyst.app.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import my.portfolioanalyst.app.dto.AnalysisJobResponseDto;
import my.portfolioanalyst.app.dto.AnalysisRunRequestDto;
import my.portfolioanalyst.app.importer.HoldingsParser;
import my.portfolioanalyst.app.model.AnalysisReport;
import my.portfolioanalyst.app.model.AnalysisRequest;
import my.portfolioanalyst.app.model.DispatchMode;
import my.portfolioanalyst.app.model.Holding;
import my.portfolioanalyst.app.service.AnalysisJobService;
import my.portfolioanalyst.app.service.PortfolioAnalysisService;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/analysis")
@Tag(name = "Portfolio Analysis")
public class AnalysisController {
	private final PortfolioAnalysisService analysisService;
	private final AnalysisJobService analysisJobService;
	private final HoldingsParser holdingsParser;

	public AnalysisController(PortfolioAnalysisService analysisService,
							  AnalysisJobService analysisJobService,
							  HoldingsParser holdingsParser) {
		this.analysisService = analysisService;
		this.analysisJobService = analysisJobService;
		this.holdingsParser = holdingsParser;
	}

	@PostMapping("/run")
	@Operation(summary = "Analyze holdings and return the aggregated report")
	public AnalysisReport run(@Valid @RequestBody AnalysisRunRequestDto request) {
		return analysisService.analyze(request.toRequest());
	}

	@PostMapping(path = "/run/csv", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
	@Operation(summary = "Analyze holdings uploaded as CSV")
	public AnalysisReport runCsv(@RequestParam("file") MultipartFile file,
								 @RequestParam(value = "mode", defaultValue = "PER_ENTITY") DispatchMode mode,
								 @RequestParam(value = "followUp", required = false) Boolean followUp,
								 @RequestParam(value = "deliver", defaultValue = "false") boolean deliver) {
		List<Holding> holdings = readHoldings(file);
		return analysisService.analyze(new AnalysisRequest(holdings, mode, Map.of(), followUp, deliver, null));
	}

	@PostMapping("/jobs")
	@ResponseStatus(HttpStatus.ACCEPTED)
	@Operation(summary = "Start an asynchronous analysis job")
	public AnalysisJobResponseDto startJob(@Valid @RequestBody AnalysisRunRequestDto request) {
		return analysisJobService.start(request.toRequest());
	}

	@GetMapping("/jobs/{jobId}")
	@Operation(summary = "Get analysis job status and report")
	public AnalysisJobResponseDto getJob(@PathVariable("jobId") String jobId) {
		return analysisJobService.get(jobId);
	}

	@DeleteMapping("/jobs/{jobId}")
	@Operation(summary = "Cancel a pending or running analysis job")
	public AnalysisJobResponseDto cancelJob(@PathVariable("jobId") String jobId) {
		return analysisJobService.cancel(jobId);
	}

	private List<Holding> readHoldings(MultipartFile file) {
		if (file == null || file.isEmpty()) {
			throw new IllegalArgumentException("Holdings file is required");
		}
		try {
			return holdingsParser.parse(file.getBytes());
		} catch (IOException exc) {
			throw new IllegalArgumentException("Failed to read holdings file: " + exc.getMessage(), exc);
		}
	}
}

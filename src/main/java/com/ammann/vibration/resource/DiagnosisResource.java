/* (C)2026 */
package com.ammann.vibration.resource;

import com.ammann.vibration.dto.SampleRateResponseDTO;
import com.ammann.vibration.dto.SheetDiagnosisDTO;
import com.ammann.vibration.dto.SheetDiagnosisRequestDTO;
import com.ammann.vibration.dto.WorkbookDiagnosisDTO;
import com.ammann.vibration.dto.WorkbookDiagnosisRequestDTO;
import com.ammann.vibration.exception.ValidationException;
import com.ammann.vibration.model.AnalysisConfiguration;
import com.ammann.vibration.model.NormalizationResult;
import com.ammann.vibration.model.NormalizedSample;
import com.ammann.vibration.model.Sheet;
import com.ammann.vibration.model.SheetOutcome;
import com.ammann.vibration.model.WorkbookDiagnosis;
import com.ammann.vibration.properties.ApiProperties;
import com.ammann.vibration.service.DiagnosisAggregatorService;
import com.ammann.vibration.service.DiagnosisService;
import com.ammann.vibration.service.SampleRateEstimatorService;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

/**
 * REST resource for vibration fault diagnosis of rotating machinery.
 *
 * <p>Accepts sheets already tabulated by the ingestion layer and returns diagnosis records
 * for the reporting layer. A single sheet with missing columns is rejected with 400; in a
 * workbook the same sheet is listed as skipped and the remaining sheets are still diagnosed.
 */
@Path(ApiProperties.BASE_URL_V1)
@Tag(name = "Diagnosis API", description = "Rolling-RMS and spectral fault diagnosis")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class DiagnosisResource {

    private static final Logger LOG = Logger.getLogger(DiagnosisResource.class);

    @Inject
    DiagnosisService diagnosisService;

    @Inject
    DiagnosisAggregatorService aggregatorService;

    @POST
    @Path(ApiProperties.Diagnosis.SHEET)
    @Operation(
            summary = "Diagnose a single sheet",
            description = "Runs the RMS, standard deviation or spectral diagnosis over one asset sheet"
    )
    @APIResponses({
            @APIResponse(responseCode = "200", description = "Diagnosis completed or insufficient data",
                    content = @Content(schema = @Schema(implementation = SheetDiagnosisDTO.class))),
            @APIResponse(responseCode = "400", description = "Missing columns or invalid options"),
            @APIResponse(responseCode = "500", description = "Internal server error")
    })
    public Response diagnoseSheet(@Valid SheetDiagnosisRequestDTO request) {
        if (request == null || request.sheet() == null) {
            throw ValidationException.invalidParameter("sheet", "null", "a sheet with rows");
        }

        AnalysisConfiguration config = request.toConfiguration();
        Sheet sheet = request.sheet().toSheet();

        LOG.debugf("Sheet diagnosis request: sheet=%s, rows=%d, mode=%s, axial=%s",
                sheet.name(), sheet.rowCount(), config.mode(), config.axialAxis());

        SheetOutcome outcome = diagnosisService.diagnose(sheet, config);
        if (!outcome.isValid()) {
            throw ValidationException.invalidSchema(sheet.name(), outcome.missingColumns());
        }

        return Response.ok(SheetDiagnosisDTO.from(outcome.diagnosis())).build();
    }

    @POST
    @Path(ApiProperties.Diagnosis.WORKBOOK)
    @Operation(
            summary = "Diagnose every sheet of a workbook",
            description = "Diagnoses each sheet independently; sheets with missing columns or processing errors are skipped"
    )
    @APIResponses({
            @APIResponse(responseCode = "200", description = "Workbook diagnosis completed",
                    content = @Content(schema = @Schema(implementation = WorkbookDiagnosisDTO.class))),
            @APIResponse(responseCode = "400", description = "Invalid options or empty workbook"),
            @APIResponse(responseCode = "500", description = "Internal server error")
    })
    public Response diagnoseWorkbook(@Valid WorkbookDiagnosisRequestDTO request) {
        if (request == null || request.sheets() == null || request.sheets().isEmpty()) {
            throw ValidationException.insufficientData("sheets", 1, 0);
        }

        AnalysisConfiguration config = request.toConfiguration();
        List<Sheet> sheets = request.toSheets();

        long startTime = System.currentTimeMillis();
        WorkbookDiagnosis workbook = aggregatorService.diagnoseWorkbook(sheets, config,
                (processed, total, sheetName) -> LOG.debugf("Processed %d/%d sheets (%s)", processed, total, sheetName));
        long elapsed = System.currentTimeMillis() - startTime;

        LOG.infof("Workbook diagnosis: %d sheets, %d diagnosed, %d skipped in %dms",
                workbook.totalSheets(), workbook.sheets().size(), workbook.skipped().size(), elapsed);
        return Response.ok(WorkbookDiagnosisDTO.from(workbook, elapsed)).build();
    }

    @POST
    @Path(ApiProperties.Diagnosis.SAMPLE_RATE)
    @Operation(
            summary = "Estimate sample rate",
            description = "Normalizes a sheet and reports its median-interval sample rate"
    )
    @APIResponses({
            @APIResponse(responseCode = "200", description = "Sample rate estimated",
                    content = @Content(schema = @Schema(implementation = SampleRateResponseDTO.class))),
            @APIResponse(responseCode = "400", description = "Missing columns or invalid options"),
            @APIResponse(responseCode = "500", description = "Internal server error")
    })
    public Response estimateSampleRate(@Valid SheetDiagnosisRequestDTO request) {
        if (request == null || request.sheet() == null) {
            throw ValidationException.invalidParameter("sheet", "null", "a sheet with rows");
        }

        AnalysisConfiguration config = request.toConfiguration();
        Sheet sheet = request.sheet().toSheet();

        NormalizationResult normalized = diagnosisService.normalize(sheet, config);
        if (!normalized.valid()) {
            throw ValidationException.invalidSchema(sheet.name(), normalized.missingColumns());
        }

        List<NormalizedSample> samples = normalized.samples();
        double rate = diagnosisService.estimateSampleRate(samples);

        var response = new SampleRateResponseDTO(
                sheet.name(),
                rate,
                rate > SampleRateEstimatorService.UNDETERMINED,
                samples.size(),
                normalized.droppedRows(),
                normalized.layout(),
                samples.isEmpty() ? null : samples.get(0).t(),
                samples.isEmpty() ? null : samples.get(samples.size() - 1).t()
        );

        LOG.infof("Sample rate for sheet '%s': %.4f Hz from %d samples", sheet.name(), rate, samples.size());
        return Response.ok(response).build();
    }
}

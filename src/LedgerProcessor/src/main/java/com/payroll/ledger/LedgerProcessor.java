package com.payroll.ledger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.payroll.ledger.model.PayrollRunRejection;
import com.payroll.ledger.model.PayrollRunRequest;
import com.payroll.taxengine.PayrollJson;
import com.payroll.taxengine.calc.PayrollTaxEngine;
import com.payroll.taxengine.error.InvalidInputException;
import com.payroll.taxengine.error.PayrollTaxException;
import com.payroll.taxengine.ledger.PayrollLedgerRow;
import org.apache.kafka.streams.processor.api.Processor;
import org.apache.kafka.streams.processor.api.ProcessorContext;
import org.apache.kafka.streams.processor.api.Record;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns payroll-run requests into ledger rows. A request the engine rejects, or one that
 * cannot be parsed, is forwarded to the rejection sink and never reaches the ledger.
 */
public class LedgerProcessor implements Processor<String, String, String, String> {

    private static final Logger log = LoggerFactory.getLogger(LedgerProcessor.class);
    private static final ObjectMapper mapper = PayrollJson.mapper();

    private final PayrollTaxEngine engine;
    private final LedgerHistory history;
    private ProcessorContext<String, String> context;

    public LedgerProcessor(PayrollTaxEngine engine, LedgerHistory history) {
        this.engine = engine;
        this.history = history;
    }

    @Override
    public void init(ProcessorContext<String, String> context) {
        this.context = context;
    }

    @Override
    public void process(Record<String, String> record) {
        if (record.value() == null) return;

        PayrollRunRequest request = null;
        try {
            request = mapper.readValue(record.value(), PayrollRunRequest.class);
            PayrollLedgerRow row = compute(request);
            history.record(row);

            context.forward(new Record<>(ledgerKey(row), mapper.writeValueAsString(row), record.timestamp()),
                LedgerProcessorApp.LEDGER_SINK);
            log.info("Ledger row {}: gross={}, net={}",
                row.key(), row.grossPay().toPlainString(), row.getNetPay().toPlainString());
        } catch (PayrollTaxException e) {
            log.warn("Rejected payroll run {}: {}", describe(request), e.describe());
            reject(record, request, e.getKind().name(), e.getMessage(), e);
        } catch (JsonProcessingException e) {
            PayrollTaxException cause = engineCause(e);
            if (cause != null) {
                log.warn("Rejected payroll run: {}", cause.describe());
                reject(record, null, cause.getKind().name(), cause.getMessage(), cause);
            } else {
                log.error("Unparseable payroll run request: {}", e.getOriginalMessage());
                reject(record, null, PayrollRunRejection.MALFORMED_REQUEST, e.getOriginalMessage(), null);
            }
        } catch (RuntimeException e) {
            log.error("Error processing payroll run {}: {}", describe(request), e.getMessage(), e);
            reject(record, request, PayrollRunRejection.PROCESSING_ERROR, String.valueOf(e.getMessage()), null);
        }
    }

    private PayrollLedgerRow compute(PayrollRunRequest request) {
        if (request.getCompany() == null || request.getEmployee() == null || request.getRun() == null) {
            throw new InvalidInputException("request", "company, employee and run are all required");
        }
        if (request.getPriorYtd() != null) {
            return engine.compute(request.getCompany(), request.getEmployee(), request.getRun(),
                request.getPriorYtd());
        }
        return engine.computeFromLedger(request.getCompany(), request.getEmployee(), request.getRun(),
            history.rowsFor(request.getCompany().getCompanyId(), request.getEmployee().getEmployeeId()));
    }

    private void reject(Record<String, String> record, PayrollRunRequest request, String kind,
                        String message, PayrollTaxException cause) {
        PayrollRunRejection rejection = new PayrollRunRejection();
        if (request != null) {
            if (request.getCompany() != null) rejection.setCompanyId(request.getCompany().getCompanyId());
            if (request.getEmployee() != null) rejection.setEmployeeId(request.getEmployee().getEmployeeId());
            if (request.getRun() != null && request.getRun().getPayDate() != null) {
                rejection.setPayDate(request.getRun().getPayDate().toString());
            }
        }
        rejection.setErrorKind(kind);
        rejection.setMessage(message);
        if (cause != null) rejection.setFailures(cause.getFailures());

        try {
            context.forward(new Record<>(record.key(), mapper.writeValueAsString(rejection), record.timestamp()),
                LedgerProcessorApp.REJECTION_SINK);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize rejection for {}: {}", describe(request), e.getMessage(), e);
        }
    }

    // Jackson wraps exceptions thrown from @JsonCreator factories
    private static PayrollTaxException engineCause(Throwable e) {
        for (Throwable t = e.getCause(); t != null; t = t.getCause()) {
            if (t instanceof PayrollTaxException) return (PayrollTaxException) t;
        }
        return null;
    }

    private static String ledgerKey(PayrollLedgerRow row) throws JsonProcessingException {
        return mapper.writeValueAsString(mapper.createObjectNode()
            .put("companyId", row.getCompanyId())
            .put("employeeId", row.getEmployeeId())
            .put("payDate", row.getPayDate().toString()));
    }

    private static String describe(PayrollRunRequest request) {
        if (request == null) return "<unparsed>";
        String company = request.getCompany() != null ? request.getCompany().getCompanyId() : null;
        String employee = request.getEmployee() != null ? request.getEmployee().getEmployeeId() : null;
        String payDate = request.getRun() != null ? String.valueOf(request.getRun().getPayDate()) : null;
        return company + "/" + employee + "/" + payDate;
    }
}

package ebulter.hanabi.store.model;

public class TransferResult {
    private boolean success;
    private int recordCount;
    private String message;
    private String json;

    public TransferResult() {
    }

    public TransferResult(boolean success, int recordCount, String message) {
        this(success, recordCount, message, null);
    }

    public TransferResult(boolean success, int recordCount, String message, String json) {
        this.success = success;
        this.recordCount = recordCount;
        this.message = message;
        this.json = json;
    }

    public boolean isSuccess() {
        return success;
    }

    public void setSuccess(boolean success) {
        this.success = success;
    }

    public int getRecordCount() {
        return recordCount;
    }

    public void setRecordCount(int recordCount) {
        this.recordCount = recordCount;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    /**
     * Exported JSON, only set for exports
     */
    public String getJson() {
        return json;
    }

    public void setJson(String json) {
        this.json = json;
    }
}

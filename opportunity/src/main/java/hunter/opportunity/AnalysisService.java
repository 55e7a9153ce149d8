package hunter.opportunity;

/**
 * Produces an opportunity brief for an account. Must be safe to call again
 * for the same account: a retried attempt may repeat a call whose result was
 * never recorded.
 */
public interface AnalysisService {
    OpportunityBrief analyze(AccountContext account) throws OpportunityServiceException;
}

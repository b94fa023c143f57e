/**
 * Error taxonomy of the run lifecycle engine.
 *
 * <p><strong>Categories:</strong></p>
 * <ul>
 *   <li><strong>CallerError</strong> (unchecked, {@link java.lang.IllegalArgumentException} subtypes):
 *       {@link com.ryuqq.wes.core.error.InvalidSubmissionException},
 *       {@link com.ryuqq.wes.core.error.UnknownProviderException},
 *       {@link com.ryuqq.wes.core.error.InvalidPageTokenException}</li>
 *   <li><strong>TransientProviderError</strong> (checked):
 *       {@link com.ryuqq.wes.core.error.ProviderUnavailableException}</li>
 *   <li><strong>PermanentProviderError</strong> (checked):
 *       {@link com.ryuqq.wes.core.error.ProviderSubmissionException},
 *       {@link com.ryuqq.wes.core.error.ProviderRunNotFoundException}</li>
 *   <li><strong>EngineFault</strong> (unchecked):
 *       {@link com.ryuqq.wes.core.error.RunStoreException}</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.wes.core.error;

/**
 * Interview orchestration: the {@link com.phillippitts.interviewengine.service.orchestration.InterviewEngine}
 * entry point, its default implementation and builder, the metrics publisher, and the
 * application events emitted while sessions run (see the {@code event} sub-package).
 *
 * @since 1.0
 */
package com.phillippitts.interviewengine.service.orchestration;

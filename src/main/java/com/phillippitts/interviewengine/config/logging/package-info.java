/**
 * Request logging context: {@link com.phillippitts.interviewengine.config.logging.MdcFilter}
 * populates requestId and userId for every HTTP request.
 */
package com.phillippitts.interviewengine.config.logging;

/**
 * cryostar: STAR metadata interchange for cryo-EM image processing.
 *
 * Copyright (C) 2015 The cryostar authors
 *
 * This file is part of cryostar.
 *
 * cryostar is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */
package org.cryostar.testutil;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.testng.IInvokedMethod;
import org.testng.IInvokedMethodListener;
import org.testng.ITestNGMethod;
import org.testng.ITestResult;

/**
 * TestNG listener logging each test method before it runs and its outcome afterwards, so test output in the log can
 * be attributed to a test.
 * 
 * <p>
 * Registered for all modules in the surefire configuration of the parent pom.
 */
public class LoggingTestNgListener implements IInvokedMethodListener {
  private static final Logger logger = LoggerFactory.getLogger(LoggingTestNgListener.class);

  @Override
  public void beforeInvocation(IInvokedMethod method, ITestResult testResult) {
    if (method.isTestMethod())
      logger.info(">>> {}", name(method.getTestMethod()));
  }

  @Override
  public void afterInvocation(IInvokedMethod method, ITestResult testResult) {
    if (!method.isTestMethod())
      return;
    long millis = testResult.getEndMillis() - testResult.getStartMillis();
    switch (testResult.getStatus()) {
    case ITestResult.SUCCESS:
      logger.info("<<< {} passed ({} ms)", name(method.getTestMethod()), millis);
      break;
    case ITestResult.FAILURE:
      logger.warn("<<< {} FAILED ({} ms): {}", name(method.getTestMethod()), millis,
          String.valueOf(testResult.getThrowable()));
      break;
    default:
      logger.info("<<< {} finished with status {}", name(method.getTestMethod()), testResult.getStatus());
    }
  }

  private static String name(ITestNGMethod testMethod) {
    return testMethod.getTestClass().getName() + "#" + testMethod.getMethodName();
  }
}

/**
 * Default reader and writer implementations, backed by the StAX
 * ({@code javax.xml.stream}) token reader and writer of the JDK.
 */
package com.questrail.opendrive.codec.impl;

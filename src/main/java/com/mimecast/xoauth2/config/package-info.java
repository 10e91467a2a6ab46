/**
 * JSON5 configuration accessors.
 */
package com.mimecast.xoauth2.config;

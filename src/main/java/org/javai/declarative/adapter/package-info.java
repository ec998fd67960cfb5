/**
 * One adapter per supported resource type, mapping change fields to typed requests
 * and calling the remote API.
 */
package org.javai.declarative.adapter;

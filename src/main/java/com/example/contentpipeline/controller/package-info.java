/**
 * REST controllers for submitting pipeline executions and reading their state.
 */
package com.example.contentpipeline.controller;
